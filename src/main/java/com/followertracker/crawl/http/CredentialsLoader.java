package com.followertracker.crawl.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class CredentialsLoader {
    static final String BEARER_TOKEN_KEY = "bearer_token";

    private final ObjectMapper objectMapper;

    public CredentialsLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ApiCredentials load(Path credentialsJson) {
        if (credentialsJson == null || !Files.isRegularFile(credentialsJson)) {
            throw new CredentialsException("Could not find credentials at " + credentialsJson);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(credentialsJson.toFile());
        } catch (IOException e) {
            throw new CredentialsException("Could not read credentials at " + credentialsJson, e);
        }
        JsonNode token = root == null ? null : root.get(BEARER_TOKEN_KEY);
        if (token == null || !token.isTextual() || token.asText().isBlank()) {
            throw new CredentialsException(credentialsJson + " is expected to have a non-blank " + BEARER_TOKEN_KEY);
        }
        return new ApiCredentials(token.asText());
    }
}
