package com.example.datalake.kbscore.display;

/** CSS utility classes used to render a status badge. */
public record Palette(String bg, String text, String border, String light) {}
