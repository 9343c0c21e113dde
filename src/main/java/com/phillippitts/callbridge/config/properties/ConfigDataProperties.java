package com.phillippitts.callbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of business configuration files (prompt, knowledge, contacts, transfer numbers).
 */
@Validated
@ConfigurationProperties(prefix = "callbridge.data")
public class ConfigDataProperties {

    @NotBlank
    private String directory = "config";

    /** Business name spoken in the default greetings. */
    @NotBlank
    private String businessName = "Apex AI Solutions";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getBusinessName() {
        return businessName;
    }

    public void setBusinessName(String businessName) {
        this.businessName = businessName;
    }
}
