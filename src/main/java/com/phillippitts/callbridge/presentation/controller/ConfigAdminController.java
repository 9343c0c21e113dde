package com.phillippitts.callbridge.presentation.controller;

import com.phillippitts.callbridge.service.data.ConfigDataRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Reloads business configuration (prompt, knowledge, contacts, transfer numbers) without a restart.
 * Calls already in progress keep the instructions they were accepted with.
 */
@RestController
class ConfigAdminController {

    private static final Logger LOG = LogManager.getLogger(ConfigAdminController.class);

    private final ConfigDataRepository configData;

    ConfigAdminController(ConfigDataRepository configData) {
        this.configData = configData;
    }

    @PostMapping("/admin/config/reload")
    ResponseEntity<Void> reload() {
        LOG.info("Config reload requested");
        configData.reload();
        return ResponseEntity.noContent().build();
    }
}
