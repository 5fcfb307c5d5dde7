// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Draft store that keeps the draft in memory only.
 */
public final class InMemoryDraftStore implements DraftStore {

    private final AtomicReference<SendDraft> draft = new AtomicReference<>();

    @Override
    public Optional<SendDraft> load() {
        return Optional.ofNullable(draft.get());
    }

    @Override
    public void save(final SendDraft draft) {
        this.draft.set(Objects.requireNonNull(draft, "draft"));
    }

    @Override
    public void clear() {
        draft.set(null);
    }
}
