package com.tsa.core;

import com.tsa.condition.Condition;
import com.tsa.condition.ConditionCompiler;
import com.tsa.condition.ConditionId;
import com.tsa.exception.DuplicateConditionException;
import com.tsa.exception.TsaException;
import com.tsa.interval.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conditions sharing one analysis window, keyed by {@code site_alias}.
 * <p>
 * Rows that cannot be compiled, and rows whose id is already taken, are
 * skipped and recorded in {@link #getErrors()}.
 */
public class CondCollection {

    private static final Logger log = LoggerFactory.getLogger(CondCollection.class);

    private final String title;
    private final TimeWindow window;
    private final ConditionCompiler compiler;
    private final Map<String, Condition> conditions = new LinkedHashMap<>();
    private final ErrorCollection errors;

    /**
     * @throws com.tsa.exception.ConfigurationException if {@code from} is not before {@code until}
     */
    public CondCollection(String title, LocalDateTime from, LocalDateTime until, ConditionCompiler compiler) {
        this.title = title;
        this.window = new TimeWindow(from, until);
        this.compiler = compiler;
        this.errors = new ErrorCollection("COLLECTION <" + title + ">");
    }

    public boolean addCondition(String site, String masterAlias, String rawCondition) {
        return addCondition(site, masterAlias, rawCondition, -1);
    }

    /**
     * Compile and add a condition.
     *
     * @return true if added, false if the row was skipped with an error
     */
    public synchronized boolean addCondition(String site, String masterAlias, String rawCondition, int sourceRow) {
        Condition candidate;
        try {
            candidate = compiler.compile(site, masterAlias, rawCondition, sourceRow);
        } catch (TsaException e) {
            log.error("{}: could not build condition {}/{}, skipping: {}", errors.getContext(), site, masterAlias,
                    e.getMessage());
            errors.add(e, site + "/" + masterAlias, sourceRow);
            return false;
        }

        String key = candidate.getId().key();
        if (conditions.containsKey(key)) {
            DuplicateConditionException e = new DuplicateConditionException(key);
            log.warn("{}: {}, skipping row {}", errors.getContext(), e.getMessage(), sourceRow);
            errors.add(e, key, sourceRow);
            return false;
        }

        conditions.put(key, candidate);
        log.debug("{}: added {}", errors.getContext(), key);
        return true;
    }

    public String getTitle() {
        return title;
    }

    public TimeWindow getWindow() {
        return window;
    }

    public ErrorCollection getErrors() {
        return errors;
    }

    public synchronized Condition getCondition(String key) {
        return conditions.get(key);
    }

    public Condition getCondition(ConditionId id) {
        return getCondition(id.key());
    }

    public synchronized boolean contains(ConditionId id) {
        return conditions.containsKey(id.key());
    }

    /**
     * Conditions in insertion order.
     */
    public synchronized List<Condition> getConditions() {
        return Collections.unmodifiableList(new ArrayList<>(conditions.values()));
    }

    public synchronized int size() {
        return conditions.size();
    }

    @Override
    public String toString() {
        return "CondCollection <" + title + ">: " + window.from().toLocalDate() + "-"
                + window.until().toLocalDate() + ", " + size() + " conditions";
    }
}
