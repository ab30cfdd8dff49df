package com.tickwork.admin;

/**
 * Job fields as entered in the admin surface.
 *
 * @param times run budget, null or 0 for unlimited
 * @param args  argument text; valid JSON is passed as parsed, anything else as a plain string
 */
public record JobForm(String name, String functionName, String cronExpression, Integer times, String args) {

    int timesOrUnlimited() {
        return times == null ? 0 : times;
    }
}
