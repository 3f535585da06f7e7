package com.forecastbench.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class ScoreMapConverter implements AttributeConverter<Map<String, Double>, String> {

    private static final TypeReference<LinkedHashMap<String, Double>> TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Map<String, Double> scores) {
        if (scores == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(scores);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize scores " + scores, ex);
        }
    }

    @Override
    public Map<String, Double> convertToEntityAttribute(String json) {
        if (json == null) {
            return null;
        }
        try {
            return mapper.readValue(json, TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not read stored scores", ex);
        }
    }
}
