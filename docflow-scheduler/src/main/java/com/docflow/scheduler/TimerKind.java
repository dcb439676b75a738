package com.docflow.scheduler;

public enum TimerKind {
    /** Timer node duration; firing releases the branch and runs timeout actions */
    TIMEOUT,
    /** One firing of an escalation rule on a waiting node */
    ESCALATION
}
