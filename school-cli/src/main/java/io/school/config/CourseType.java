package io.school.config;

import io.school.core.schema.ConfigValueException;
import io.school.core.schema.RecordShape;
import io.school.core.schema.RecordValue;
import io.school.core.schema.ScalarKind;
import io.school.core.schema.ScalarShape;

/**
 * A kind of course meeting, such as a lecture or a lab.
 *
 * @param color 256-colour palette index the type is painted with
 * @param hasHomework whether meetings of this type hand out homework
 */
public record CourseType(int color, boolean hasHomework) {

  static final RecordShape SHAPE =
      RecordShape.builder("CourseType")
          .field("color", ScalarShape.required(ScalarKind.INTEGER))
          .field("has_homework", ScalarShape.required(ScalarKind.BOOLEAN))
          .build();

  static CourseType fromRecord(RecordValue record) {
    long color = record.integer("color");
    if (color < 0 || color > 255) {
      throw new ConfigValueException(
          record.pathOf("color"), "must be a colour index between 0 and 255 but was " + color);
    }
    return new CourseType((int) color, record.bool("has_homework"));
  }
}
