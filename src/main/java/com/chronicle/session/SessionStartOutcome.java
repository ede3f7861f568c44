package com.chronicle.session;

import java.util.Map;
import java.util.Optional;

import com.chronicle.storage.SaveResult;
import com.chronicle.storage.SessionRecord;

public final class SessionStartOutcome {

    private final SaveResult saveResult;
    private final SessionRecord session;
    private final Map<String, Object> eventData;
    private final String additionalContext;

    public SessionStartOutcome(SaveResult saveResult, SessionRecord session, Map<String, Object> eventData,
            String additionalContext) {
        this.saveResult = saveResult;
        this.session = session;
        this.eventData = eventData;
        this.additionalContext = additionalContext;
    }

    public SaveResult getSaveResult() { return saveResult; }

    /** The session as submitted, carrying project and git context. */
    public SessionRecord getSession() { return session; }

    /** Fields to add to the persisted session_start event. */
    public Map<String, Object> getEventData() { return eventData; }

    public Optional<String> getAdditionalContext() { return Optional.ofNullable(additionalContext); }
}
