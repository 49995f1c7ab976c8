package com.shlokmestry.bandwidth.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Serves generated bodies of a requested size; the bandwidth filter paces them.
 */
@RestController
@RequestMapping("/v1")
public class PayloadController {

    static final int MAX_SIZE = 16 * 1024 * 1024;

    @GetMapping(value = "/payload", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public byte[] payload(@RequestParam @Min(0) @Max(MAX_SIZE) int size) {
        return generate(size);
    }

    @GetMapping(value = "/plans/{plan}/payload", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public byte[] planPayload(
            @PathVariable @NotBlank String plan,
            @RequestParam @Min(0) @Max(MAX_SIZE) int size
    ) {
        return generate(size);
    }

    static byte[] generate(int size) {
        byte[] body = new byte[size];
        for (int i = 0; i < size; i++) {
            body[i] = (byte) ('a' + i % 26);
        }
        return body;
    }
}
