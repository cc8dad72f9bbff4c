package com.gamefamily.model;

public record LinkResult(FamilyMember senior, FamilyMember junior) {}
