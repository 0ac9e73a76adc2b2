package org.waabox.swipermonitor.notify;

import java.util.List;
import java.util.Objects;

/**
 * A transport-agnostic notification: a header line, an ordered list of
 * labeled fields, and a free-text comment.
 *
 * <p>Instances are immutable; the field list is copied on construction.
 *
 * @param header  the header text, never null
 * @param fields  the labeled fields in display order, never null
 * @param comment the free-text comment section, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NotificationPayload(
    String header,
    List<Field> fields,
    String comment
) {

  /**
   * Creates a new payload.
   *
   * @throws NullPointerException if any component is null
   */
  public NotificationPayload {
    Objects.requireNonNull(header, "header must not be null");
    Objects.requireNonNull(fields, "fields must not be null");
    Objects.requireNonNull(comment, "comment must not be null");
    fields = List.copyOf(fields);
  }

  /**
   * Returns the value of the first field with the given label.
   *
   * @param label the field label, never null
   *
   * @return the value, or null if no field has that label
   */
  public String fieldValue(final String label) {
    Objects.requireNonNull(label, "label must not be null");
    for (final Field field : fields) {
      if (field.label().equals(label)) {
        return field.value();
      }
    }
    return null;
  }

  /**
   * A labeled value shown in the notification body.
   *
   * @param label the label, never null
   * @param value the value, never null
   */
  public record Field(String label, String value) {

    /**
     * Creates a new field.
     *
     * @throws NullPointerException if label or value is null
     */
    public Field {
      Objects.requireNonNull(label, "label must not be null");
      Objects.requireNonNull(value, "value must not be null");
    }
  }
}
