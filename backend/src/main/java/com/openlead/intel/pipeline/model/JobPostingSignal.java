package com.openlead.intel.pipeline.model;

import java.time.LocalDate;

/**
 * The parts of a published job posting that hiring intent is derived from.
 */
public record JobPostingSignal(String title, LocalDate datePosted) {
}
