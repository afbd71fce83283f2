package io.github.riemr.cpe.application.dto;

/**
 * Credit earned by one attendee.
 *
 * @param cpe     quarter-unit credit, 0..max
 * @param minutes qualifying minutes behind the credit
 */
public record CpeResult(double cpe, double minutes) {
}
