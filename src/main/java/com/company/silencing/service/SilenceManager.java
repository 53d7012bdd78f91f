package com.company.silencing.service;

import com.company.silencing.domain.Silence;
import com.company.silencing.matcher.SilenceMatchResult;
import com.company.silencing.repository.SilenceFilter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for collaborators: silence CRUD, the alert silencing decision and lifecycle.
 */
public interface SilenceManager {

    Silence createSilence(Silence silence);

    Silence getSilence(String id);

    List<Silence> listSilences(SilenceFilter filter);

    /**
     * Partial update. Null fields keep their stored value; updatedAt must carry the token
     * the caller last read.
     */
    Silence updateSilence(Silence silence);

    void deleteSilence(String id);

    /**
     * Whether any silence active right now matches the labels. Never throws: any failure,
     * or a manager that is not running, yields "not silenced".
     */
    SilenceMatchResult isAlertSilenced(Map<String, String> labels);

    List<Silence> getActiveSilences();

    List<Silence> getExpiringSoon(Duration window);

    SilenceManagerStats getStats();

    ManagerState getState();

    void start();

    void stop();
}
