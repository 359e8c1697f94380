package com.gentoro.warmpath.model;

/** One position held at a company. A null {@code endYear} means the position is current. */
public record Employment(String company, String title, Integer startYear, Integer endYear) {}
