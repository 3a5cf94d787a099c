package br.com.fantasyflicks.backend.domain.model;

public enum DraftOrderType {
    RANDOM,
    MANUAL
}
