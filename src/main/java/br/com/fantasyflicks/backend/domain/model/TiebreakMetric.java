package br.com.fantasyflicks.backend.domain.model;

public enum TiebreakMetric {
    ITEM_COUNT,
    CORRECT_COUNT
}
