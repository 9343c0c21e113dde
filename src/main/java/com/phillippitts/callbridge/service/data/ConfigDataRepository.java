package com.phillippitts.callbridge.service.data;

import com.phillippitts.callbridge.config.properties.ConfigDataProperties;
import com.phillippitts.callbridge.domain.Contact;
import com.phillippitts.callbridge.domain.TransferDestination;
import com.phillippitts.callbridge.exception.ConfigDataException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * File-backed business configuration: system prompt, business knowledge, known contacts and
 * transfer destinations.
 *
 * <p>Files are read from {@code callbridge.data.directory} on first use and cached
 * process-wide until {@link #clearCache()} or {@link #reload()}. A missing file yields an
 * empty value. On the call path an unreadable or malformed file is logged and treated as
 * empty so a bad edit never blocks calls; {@link #reload()} is strict and reports it.
 *
 * <p>Files:
 * <ul>
 *   <li>{@code system-prompt.txt}: base instructions</li>
 *   <li>{@code business-info.md}: knowledge appended to the instructions</li>
 *   <li>{@code contacts.json}: phone number to contact object</li>
 *   <li>{@code transfer-numbers.json}: key to {@code {name, number, description}}</li>
 * </ul>
 */
@Repository
public class ConfigDataRepository implements DestinationResolver {

    private static final Logger LOG = LogManager.getLogger(ConfigDataRepository.class);

    static final String SYSTEM_PROMPT_FILE = "system-prompt.txt";
    static final String BUSINESS_INFO_FILE = "business-info.md";
    static final String CONTACTS_FILE = "contacts.json";
    static final String TRANSFER_NUMBERS_FILE = "transfer-numbers.json";

    /** Immutable view of all files as loaded together. */
    private record Snapshot(String systemPrompt,
                            String businessKnowledge,
                            Map<String, Contact> contacts,
                            Map<String, TransferDestination> destinations) {
    }

    private final Path directory;
    private volatile Snapshot snapshot;

    @Autowired
    public ConfigDataRepository(ConfigDataProperties properties) {
        this(Paths.get(properties.getDirectory()));
    }

    ConfigDataRepository(Path directory) {
        this.directory = directory;
    }

    public String systemPrompt() {
        return current().systemPrompt();
    }

    public String businessKnowledge() {
        return current().businessKnowledge();
    }

    /**
     * Looks up a known caller by the exact phone number used as key in the contacts file.
     */
    public Optional<Contact> contact(String phoneNumber) {
        if (phoneNumber == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current().contacts().get(phoneNumber));
    }

    @Override
    public Optional<TransferDestination> resolve(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(current().destinations().get(key));
    }

    @Override
    public Map<String, TransferDestination> all() {
        return current().destinations();
    }

    /**
     * Drops all cached data; the next read goes back to disk.
     */
    public void clearCache() {
        snapshot = null;
        LOG.info("Config data cache cleared");
    }

    /**
     * Clears the cache and reloads every file immediately.
     *
     * @throws ConfigDataException if a file exists but cannot be read or parsed; the
     *                             previous cache stays cleared so calls fall back to lenient loading
     */
    public void reload() {
        clearCache();
        Snapshot loaded = load(true);
        snapshot = loaded;
        LOG.info("Config data reloaded from {} ({} contact(s), {} transfer destination(s))",
                directory, loaded.contacts().size(), loaded.destinations().size());
    }

    private Snapshot current() {
        Snapshot s = snapshot;
        if (s == null) {
            synchronized (this) {
                s = snapshot;
                if (s == null) {
                    s = load(false);
                    snapshot = s;
                }
            }
        }
        return s;
    }

    private Snapshot load(boolean strict) {
        return new Snapshot(
                readText(SYSTEM_PROMPT_FILE, strict),
                readText(BUSINESS_INFO_FILE, strict),
                parseContacts(readJson(CONTACTS_FILE, strict)),
                parseDestinations(readJson(TRANSFER_NUMBERS_FILE, strict)));
    }

    private String readText(String fileName, boolean strict) {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            LOG.warn("Config data file not found: {}", file);
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            return onLoadFailure(fileName, ex, strict, "");
        }
    }

    private JSONObject readJson(String fileName, boolean strict) {
        String content = readText(fileName, strict);
        if (content.isBlank()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(content);
        } catch (JSONException ex) {
            return onLoadFailure(fileName, ex, strict, new JSONObject());
        }
    }

    private <T> T onLoadFailure(String fileName, Exception ex, boolean strict, T fallback) {
        if (strict) {
            throw new ConfigDataException(fileName, ex);
        }
        LOG.error("Failed to load config data file {}: {}", fileName, ex.getMessage());
        return fallback;
    }

    private static Map<String, Contact> parseContacts(JSONObject json) {
        Map<String, Contact> contacts = new TreeMap<>();
        for (String phone : json.keySet()) {
            JSONObject c = json.optJSONObject(phone);
            if (c == null || c.optString("name", "").isBlank()) {
                LOG.warn("Skipping contact entry without a name: {}", phone);
                continue;
            }
            contacts.put(phone, new Contact(
                    c.getString("name"),
                    emptyToNull(c.optString("company", "")),
                    emptyToNull(c.optString("role", "")),
                    c.optBoolean("vip", false),
                    emptyToNull(c.optString("notes", "")),
                    emptyToNull(c.optString("preferredGreeting", ""))));
        }
        return Collections.unmodifiableMap(contacts);
    }

    private static Map<String, TransferDestination> parseDestinations(JSONObject json) {
        Map<String, TransferDestination> destinations = new TreeMap<>();
        for (String key : json.keySet()) {
            JSONObject d = json.optJSONObject(key);
            if (d == null || d.optString("number", "").isBlank()) {
                LOG.warn("Skipping transfer destination without a number: {}", key);
                continue;
            }
            destinations.put(key, new TransferDestination(
                    key,
                    d.optString("name", key),
                    d.getString("number"),
                    d.optString("description", "")));
        }
        return Collections.unmodifiableMap(destinations);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
