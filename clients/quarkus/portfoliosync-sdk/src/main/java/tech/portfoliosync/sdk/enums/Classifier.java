package tech.portfoliosync.sdk.enums;

/**
 * Project classifier.
 */
public enum Classifier {
    APPLICATION,
    FRAMEWORK,
    LIBRARY,
    CONTAINER,
    OPERATING_SYSTEM,
    DEVICE,
    FIRMWARE,
    FILE,
    PLATFORM,
    DEVICE_DRIVER,
    MACHINE_LEARNING_MODEL,
    DATA
}
