package com.phillippitts.meetingrouter.service.extraction;

import com.phillippitts.meetingrouter.domain.ExtractionResult;
import com.phillippitts.meetingrouter.exception.RemoteServiceException;

import java.util.List;

/**
 * Extracts action items from a rendered meeting transcript.
 *
 * <p>Implementations make exactly one remote call per invocation and never retry. Callers must
 * check {@link #isEnabled()} first; a disabled gateway is a normal configuration, not an error.
 */
public interface ExtractionGateway {

    /**
     * @return true when credentials are present and {@link #extract} may be called
     */
    boolean isEnabled();

    /**
     * @param transcript   rendered transcript, one {@code [HH:MM:SS] Speaker: text} entry per line
     * @param meetingTitle display title of the meeting
     * @param participants participant display names, recorder first
     * @return meeting summary and the extracted items
     * @throws RemoteServiceException if the call fails or the response cannot be parsed
     */
    ExtractionResult extract(String transcript, String meetingTitle, List<String> participants);
}
