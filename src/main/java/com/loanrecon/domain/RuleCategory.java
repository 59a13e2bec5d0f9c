package com.loanrecon.domain;

/**
 * Regulatory family of a compliance rule.
 */
public enum RuleCategory {
    TILA,
    RESPA,
    ATR_QM,
    HPML,
    HOEPA,
    STATE,
    INVESTOR,
    DATA_INTEGRITY
}
