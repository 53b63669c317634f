/* (C)2026 */
package com.ammann.cihealth.exception;

/**
 * Base unchecked exception for all errors raised while building a CI health report.
 *
 * <p>Subclasses represent specific error categories. Failures inside a parallel aggregation
 * step are rethrown as this type with the original cause attached.
 */
public class ReportException extends RuntimeException
{
    public ReportException(String message, Throwable cause) {
        super(message, cause);
    }

    public ReportException(String message) {
        super(message);
    }
}
