package com.loyaltycard.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loyaltycard.common.exception.ErrorBody;
import com.loyaltycard.common.exception.ErrorKind;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes error bodies for requests rejected before they reach a controller.
 */
@RequiredArgsConstructor
public class JsonErrorWriter {

    private final ObjectMapper objectMapper;

    public void write(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.getHttpStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), ErrorBody.of(kind, message));
    }
}
