package com.scholary.placeholdarr.catalog;

import com.scholary.placeholdarr.media.QualityTier;
import com.scholary.placeholdarr.registry.UnitIdentity;
import java.util.Optional;

/**
 * Abstraction for the media catalog that shows placeholder titles to viewers.
 *
 * <p>Only the operations the monitor needs: locating a unit's catalog item and renaming it.
 */
public interface CatalogClient {

  /**
   * Locate the catalog item of a unit.
   *
   * @param identity movie or episode identity
   * @param tier tier whose library holds the item
   * @return the catalog item reference, or empty if the catalog does not know it yet
   * @throws CatalogException if the lookup fails after retries
   */
  Optional<String> findCatalogRef(UnitIdentity identity, QualityTier tier);

  /**
   * Replace the visible title of a catalog item and lock it against metadata refreshes.
   *
   * @param identity identity of the unit the item belongs to
   * @param tier tier whose library holds the item
   * @param catalogRef catalog item reference
   * @param title the new title
   * @return true if renamed, false if the item no longer exists
   * @throws CatalogException if the rename fails after retries
   */
  boolean renameTitle(UnitIdentity identity, QualityTier tier, String catalogRef, String title);
}
