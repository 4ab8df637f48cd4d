/**
 * Parse-then-validate boundary between raw model text and typed domain records.
 *
 * <p>{@link com.phillippitts.labreasoning.service.parse.LenientJsonParser} tolerates markdown code
 * fences and throws {@link com.phillippitts.labreasoning.exception.ResponseParseException} when no
 * JSON object can be recovered. Layer parsers apply field defaults; nothing untyped leaves this
 * package.
 */
package com.phillippitts.labreasoning.service.parse;
