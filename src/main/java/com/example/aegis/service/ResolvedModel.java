package com.example.aegis.service;

import lombok.Value;

/**
 * Public alias requested by the caller and the backend model it maps to
 */
@Value
public class ResolvedModel {
    String alias;
    String backendModel;
}
