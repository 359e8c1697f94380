package com.gentoro.warmpath.model;

public record Education(String school, String degree, String major, Integer graduationYear) {}
