package com.autonomous.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Capability {
    private String name;
    private String description;
    private Map<String, String> parameters = new LinkedHashMap<>();
}
