package com.pipeline.model.transform;

/**
 * Typed coercions applied to a sourced field value, always in declaration order:
 * HTML stripping, epoch formatting, integer conversion, string conversion.
 *
 * @param cleanHtml       strip tags and entities from text values
 * @param timestampFormat when non-null, epoch seconds are rendered with this format
 *                        (strftime directives or a {@code java.time} pattern)
 * @param toInt           best-effort integer conversion
 * @param toStr           render the value as text
 */
public record FieldCoercions(boolean cleanHtml, String timestampFormat, boolean toInt, boolean toStr) {
}
