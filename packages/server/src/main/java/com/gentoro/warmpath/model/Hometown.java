package com.gentoro.warmpath.model;

public record Hometown(String city, String region, String country) {}
