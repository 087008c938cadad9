package workqueue.model;

import java.util.Objects;

/**
 * Validation for category names (the queue partition key).
 */
public final class Category {
  public static final int MAX_LENGTH = 100;

  private Category() {}

  /**
   * @return the category, unchanged
   * @throws NullPointerException     if {@code category} is null
   * @throws IllegalArgumentException if it is blank or longer than {@value #MAX_LENGTH} characters
   */
  public static String validate(String category) {
    Objects.requireNonNull(category, "category");
    if (category.isBlank()) {
      throw new IllegalArgumentException("category must not be blank");
    }
    if (category.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "category must be at most " + MAX_LENGTH + " characters, got: " + category.length());
    }
    return category;
  }
}
