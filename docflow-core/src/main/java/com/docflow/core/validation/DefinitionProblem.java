package com.docflow.core.validation;

/**
 * One structural defect found in a workflow definition.
 *
 * @param code stable machine-readable category
 * @param subjectId id of the offending node or edge, or null for graph-wide problems
 * @param message displayable explanation
 */
public record DefinitionProblem(String code, String subjectId, String message) {

    public static final String MISSING_ID = "MISSING_ID";
    public static final String DUPLICATE_ID = "DUPLICATE_ID";
    public static final String NO_START = "NO_START_NODE";
    public static final String NO_END = "NO_END_NODE";
    public static final String START_HAS_INCOMING = "START_HAS_INCOMING";
    public static final String DANGLING_EDGE = "DANGLING_EDGE";
    public static final String UNREACHABLE_NODE = "UNREACHABLE_NODE";
    public static final String DEAD_END = "NO_OUTGOING_EDGES";
    public static final String END_HAS_OUTGOING = "END_HAS_OUTGOING";
    public static final String NO_PATH_TO_END = "NO_PATH_TO_END";
    public static final String UNGUARDED_CYCLE = "UNGUARDED_CYCLE";
    public static final String DECISION_WITHOUT_DEFAULT = "DECISION_WITHOUT_DEFAULT";
    public static final String DECISION_FOREIGN_EDGE = "DECISION_FOREIGN_EDGE";
    public static final String DECISION_UNROUTED_EDGE = "DECISION_UNROUTED_EDGE";
    public static final String JOIN_BRANCH_COUNT = "JOIN_BRANCH_COUNT";
    public static final String TIMER_WITHOUT_TRIGGER = "TIMER_WITHOUT_TRIGGER";
    public static final String INVALID_ERROR_EDGE = "INVALID_ERROR_EDGE";
    public static final String INVALID_EXPRESSION = "INVALID_EXPRESSION";
    public static final String UNKNOWN_GUARD = "UNKNOWN_GUARD";
    public static final String DUPLICATE_ACTION_ID = "DUPLICATE_ACTION_ID";
    public static final String INVALID_VARIABLE = "INVALID_VARIABLE";
    public static final String NO_DECISION_MATCH = "NO_DECISION_MATCH";
    public static final String PARSE_ERROR = "PARSE_ERROR";

    @Override
    public String toString() {
        return subjectId == null ? code + ": " + message : code + "[" + subjectId + "]: " + message;
    }
}
