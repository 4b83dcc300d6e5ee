package com.basketbot.util;

import com.basketbot.exception.ConfigurationException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads the broker access token from the token file written by the login flow.
 * The file is {@code {"access_token": "..."}} and is never rewritten here.
 */
@Slf4j
@UtilityClass
public class AccessTokenLoader {

    public static final String ACCESS_TOKEN_KEY = "access_token";

    public static String load(Path tokenFile) {
        String content;
        try {
            content = Files.readString(tokenFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Token file not found: " + tokenFile.toAbsolutePath(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read token file " + tokenFile + ": " + e.getMessage(), e);
        }

        try {
            JSONObject json = new JSONObject(content);
            String token = json.optString(ACCESS_TOKEN_KEY, "").trim();
            if (token.isEmpty()) {
                throw new ConfigurationException("Token file " + tokenFile + " has no '" + ACCESS_TOKEN_KEY + "'");
            }
            log.info("Loaded access token from {}", tokenFile);
            return token;
        } catch (JSONException e) {
            throw new ConfigurationException("Token file " + tokenFile + " is not valid JSON: " + e.getMessage(), e);
        }
    }
}
