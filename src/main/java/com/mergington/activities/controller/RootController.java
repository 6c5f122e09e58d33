package com.mergington.activities.controller;

import io.swagger.v3.oas.annotations.Hidden;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@Hidden
public class RootController {

    static final String INDEX_PAGE = "/static/index.html";

    @GetMapping("/")
    public ResponseEntity<Void> home() {
        return ResponseEntity.status(HttpStatus.TEMPORARY_REDIRECT)
            .location(URI.create(INDEX_PAGE))
            .build();
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }
}
