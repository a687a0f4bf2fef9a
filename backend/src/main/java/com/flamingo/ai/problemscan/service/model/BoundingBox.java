package com.flamingo.ai.problemscan.service.model;

import java.util.List;

/**
 * Axis-aligned rectangle in image pixel coordinates, as reported by the OCR service.
 *
 * @param x left edge
 * @param y top edge
 * @param width rectangle width
 * @param height rectangle height
 */
public record BoundingBox(double x, double y, double width, double height) {

  /** Placeholder for segments without positional information. */
  public static final BoundingBox ZERO = new BoundingBox(0, 0, 0, 0);

  /**
   * Builds a box from the OCR wire format {@code [x, y, w, h]}. Missing or non-numeric entries
   * are read as 0.
   */
  public static BoundingBox fromList(List<?> values) {
    if (values == null || values.isEmpty()) {
      return ZERO;
    }
    return new BoundingBox(at(values, 0), at(values, 1), at(values, 2), at(values, 3));
  }

  /** Returns {@code boxes[index]} when present, otherwise {@link #ZERO}. */
  public static BoundingBox atIndex(List<BoundingBox> boxes, int index) {
    if (boxes == null || index < 0 || index >= boxes.size() || boxes.get(index) == null) {
      return ZERO;
    }
    return boxes.get(index);
  }

  public List<Double> toList() {
    return List.of(x, y, width, height);
  }

  private static double at(List<?> values, int index) {
    if (index < values.size() && values.get(index) instanceof Number n) {
      return n.doubleValue();
    }
    return 0;
  }
}
