package com.example.datalake.kbscore.display;

import com.example.datalake.kbscore.model.ScoringCategory;
import java.util.Map;

/** Badge colours and icons a dashboard needs to render a scoring result. */
public record DisplayHints(
    Palette status,
    Map<ScoringCategory, Palette> categoryColors,
    Map<ScoringCategory, String> categoryIcons) {}
