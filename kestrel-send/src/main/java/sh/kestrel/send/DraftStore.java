// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Optional;
import sh.kestrel.core.error.DraftStoreException;

/**
 * Persistence for the single active send draft.
 *
 * @see JsonFileDraftStore
 * @see InMemoryDraftStore
 */
public interface DraftStore {

    /**
     * Loads the saved draft.
     *
     * @return the draft, or empty if none is saved or the saved one is unreadable
     */
    Optional<SendDraft> load();

    /**
     * Replaces the saved draft.
     *
     * @param draft the draft
     * @throws DraftStoreException if the draft could not be written
     */
    void save(SendDraft draft);

    /**
     * Removes the saved draft.
     *
     * @throws DraftStoreException if the draft could not be removed
     */
    void clear();
}
