/**
 * Micrometer instrumentation for model calls, consensus levels and end-to-end analyses.
 */
package com.phillippitts.labreasoning.service.metrics;
