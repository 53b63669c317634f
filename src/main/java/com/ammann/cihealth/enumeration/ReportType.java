/* (C)2026 */
package com.ammann.cihealth.enumeration;

/**
 * Time window a report was built for. Only {@link #CURRENT} reports carry promotion warnings.
 */
public enum ReportType
{
    CURRENT,
    TWO_DAY,
    PREVIOUS
}
