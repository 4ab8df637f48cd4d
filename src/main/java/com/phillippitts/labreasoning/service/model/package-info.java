/**
 * Model client adapter.
 *
 * <p>{@link com.phillippitts.labreasoning.service.model.ModelClient} turns a (model id, system
 * prompt, user prompt, options) tuple into raw reply text or a
 * {@link com.phillippitts.labreasoning.exception.ModelCallException}.
 * {@link com.phillippitts.labreasoning.service.model.ModelCallOutcome} records how a call
 * resolved when failures must not propagate.
 */
package com.phillippitts.labreasoning.service.model;
