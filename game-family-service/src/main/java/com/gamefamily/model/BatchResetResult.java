package com.gamefamily.model;

import java.time.Instant;

public record BatchResetResult(int affectedCount, Instant resetTime) {}
