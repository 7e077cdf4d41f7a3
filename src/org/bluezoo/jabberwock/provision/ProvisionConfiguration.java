/*
 * ProvisionConfiguration.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of jabberwock, an XMPP client library.
 *
 * jabberwock is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * jabberwock is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with jabberwock.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.jabberwock.provision;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Reads provisioner configuration.
 *
 * <p>A configuration section is a map of string keys to string values,
 * usually loaded from a properties file:
 *
 * <pre>
 * host=localhost
 * no_verify=true
 * quirks=["#muc-id-rewrite"]
 * </pre>
 *
 * <p>The recognised keys are {@code host}, {@code no_verify},
 * {@code pin_store}, {@code pin_type} and {@code quirks}. Boolean values
 * are {@code 1}, {@code yes}, {@code true} or {@code on} and their
 * opposites {@code 0}, {@code no}, {@code false} or {@code off}, in any
 * case.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ProvisionConfiguration {

    public static final String HOST = "host";
    public static final String NO_VERIFY = "no_verify";
    public static final String PIN_STORE = "pin_store";
    public static final String PIN_TYPE = "pin_type";
    public static final String QUIRKS = "quirks";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Python-style list literals
    private static final ObjectMapper LIST_MAPPER = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES,
                JsonReadFeature.ALLOW_TRAILING_COMMA,
                JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private ProvisionConfiguration() {
    }

    /**
     * Loads a section from a properties file.
     *
     * @param path the file
     * @return the section
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> load(Path path) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            properties.load(in);
        }
        Map<String, String> section = new LinkedHashMap<>();
        for (String key : properties.stringPropertyNames()) {
            section.put(key, properties.getProperty(key).trim());
        }
        return section;
    }

    /**
     * Returns a required value.
     *
     * @param section the section
     * @param key the key
     * @return the value
     * @throws ProvisioningException if the key is missing
     */
    public static String getRequired(Map<String, String> section, String key) throws ProvisioningException {
        String value = section.get(key);
        if (value == null) {
            throw new ProvisioningException(format("err.missing_key", key));
        }
        return value;
    }

    public static boolean getBoolean(Map<String, String> section, String key, boolean fallback)
            throws ProvisioningException {
        String value = section.get(key);
        if (value == null) {
            return fallback;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1":
            case "yes":
            case "true":
            case "on":
                return true;
            case "0":
            case "no":
            case "false":
            case "off":
                return false;
            default:
                throw new ProvisioningException(format("err.not_boolean", key, value));
        }
    }

    public static int getInt(Map<String, String> section, String key, int fallback) throws ProvisioningException {
        String value = section.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ProvisioningException(format("err.not_integer", key, value), e);
        }
    }

    /**
     * Reads the TLS settings of a section. When {@code no_verify} is true
     * the pin settings are ignored; otherwise a {@code pin_store} names a
     * JSON file holding an object that maps host names to arrays of base64
     * pins, and {@code pin_type} says what the pins are computed from
     * (default 0).
     *
     * @param section the section
     * @return the TLS configuration
     * @throws ProvisioningException if a setting is invalid or the pin
     *         store cannot be read
     */
    public static TLSConfiguration getTLSConfiguration(Map<String, String> section) throws ProvisioningException {
        boolean noVerify = getBoolean(section, NO_VERIFY, false);
        if (noVerify || !section.containsKey(PIN_STORE)) {
            return new TLSConfiguration(null, null, noVerify);
        }
        Path path = Paths.get(section.get(PIN_STORE));
        Map<String, List<String>> pinStore;
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            pinStore = MAPPER.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() { });
        } catch (IOException e) {
            throw new ProvisioningException(format("err.pin_store", path), e);
        }
        if (pinStore == null) {
            throw new ProvisioningException(format("err.pin_store", path));
        }
        PinType pinType = PinType.fromValue(getInt(section, PIN_TYPE, 0));
        return new TLSConfiguration(pinStore, pinType, false);
    }

    /**
     * Reads the quirks of a section. The {@code quirks} value is a list
     * literal of quoted quirk identifiers, such as
     * {@code ["#muc-id-rewrite"]}; it defaults to the empty list.
     *
     * @param section the section
     * @return the quirks
     * @throws ProvisioningException if the value is not a list of strings
     *         or names an unknown quirk
     */
    public static Set<Quirk> getQuirks(Map<String, String> section) throws ProvisioningException {
        String value = section.get(QUIRKS);
        Set<Quirk> quirks = EnumSet.noneOf(Quirk.class);
        if (value == null) {
            return quirks;
        }
        for (String s : parseStringList(value)) {
            quirks.add(Quirk.fromString(s));
        }
        return quirks;
    }

    /**
     * Parses a list literal of quoted strings: square brackets or
     * parentheses enclosing comma-separated strings in single or double
     * quotes, with an optional trailing comma.
     *
     * @param text the literal
     * @return the strings
     * @throws ProvisioningException if the text is not such a literal
     */
    public static List<String> parseStringList(String text) throws ProvisioningException {
        String s = text.trim();
        int len = s.length();
        if (len < 2) {
            throw new ProvisioningException(format("err.not_list", text));
        }
        char open = s.charAt(0);
        char close = s.charAt(len - 1);
        boolean tuple = open == '(' && close == ')';
        if (tuple) {
            s = "[" + s.substring(1, len - 1) + "]";
        } else if (open != '[' || close != ']') {
            throw new ProvisioningException(format("err.not_list", text));
        }
        JsonNode node;
        try {
            node = LIST_MAPPER.readTree(s);
        } catch (JsonProcessingException e) {
            throw new ProvisioningException(format("err.not_list", text), e);
        }
        if (node == null || !node.isArray()) {
            throw new ProvisioningException(format("err.not_list", text));
        }
        List<String> result = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ProvisioningException(format("err.not_list", text));
            }
            result.add(element.textValue());
        }
        // A one-element tuple needs its trailing comma
        if (tuple && result.size() == 1 && !s.substring(1, s.length() - 1).trim().endsWith(",")) {
            throw new ProvisioningException(format("err.not_list", text));
        }
        return Collections.unmodifiableList(result);
    }

    private static String format(String key, Object... args) {
        return MessageFormat.format(Provisioner.L10N.getString(key), args);
    }

}
