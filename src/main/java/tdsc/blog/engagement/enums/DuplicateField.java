package tdsc.blog.engagement.enums;

/**
 * User fields that must be unique
 */
public enum DuplicateField {
    USERNAME,
    EMAIL
}
