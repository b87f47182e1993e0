package com.example.aegis.service;

import lombok.Value;

import java.util.List;

/**
 * Request after normalization: {@code texts} is never empty and already within limits.
 */
@Value
public class ValidatedRequest {
    String model;
    List<String> texts;
}
