package com.wafsentinel.engine.support;

import com.wafsentinel.engine.ingest.CursorPersistenceException;
import com.wafsentinel.engine.ingest.CursorRepository;
import com.wafsentinel.engine.ingest.CursorState;

import java.io.IOException;
import java.util.Optional;

/** Cursor repository that can be told to fail the next save, simulating a crash. */
public class InMemoryCursorRepository implements CursorRepository {

    private CursorState state;
    private int saves;
    private boolean failNextSave;

    @Override
    public synchronized Optional<CursorState> load() {
        return Optional.ofNullable(state);
    }

    @Override
    public synchronized void save(CursorState next) {
        if (failNextSave) {
            failNextSave = false;
            throw new CursorPersistenceException("disk full", new IOException("No space left on device"));
        }
        state = next;
        saves++;
    }

    public synchronized void failNextSave() {
        failNextSave = true;
    }

    public synchronized CursorState current() {
        return state;
    }

    public synchronized int saves() {
        return saves;
    }
}
