package com.aiinpocket.encounter.model.dto;

public record DifficultyRange(int min, int max) {}
