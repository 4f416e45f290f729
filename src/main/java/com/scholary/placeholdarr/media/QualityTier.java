package com.scholary.placeholdarr.media;

/**
 * Backend tier a unit is acquired through.
 *
 * <p>Each media kind has a standard backend instance and optionally a second, high-quality (4K)
 * instance with its own library folder. The tier is fixed when a unit is registered.
 */
public enum QualityTier {
  STANDARD,
  HIGH_QUALITY
}
