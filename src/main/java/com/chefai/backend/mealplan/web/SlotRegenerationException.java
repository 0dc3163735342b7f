package com.chefai.backend.mealplan.web;

import com.chefai.backend.mealplan.model.MissingSlotReason;

public class SlotRegenerationException extends RuntimeException {

    private final MissingSlotReason reason;
    private final String detailCode;

    public SlotRegenerationException(MissingSlotReason reason, String detailCode) {
        super("SLOT_REGENERATION_FAILED");
        this.reason = reason;
        this.detailCode = detailCode;
    }

    public MissingSlotReason reason() { return reason; }

    /** provider / validator 的細部錯誤碼（可能為 null） */
    public String detailCode() { return detailCode; }
}
