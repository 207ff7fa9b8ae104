package com.drivehr.jobsync.sync.validation;

public record ValidationOutcome(boolean valid, String failedCheck) {

    public static ValidationOutcome passed() {
        return new ValidationOutcome(true, null);
    }

    public static ValidationOutcome failed(String failedCheck) {
        return new ValidationOutcome(false, failedCheck);
    }
}
