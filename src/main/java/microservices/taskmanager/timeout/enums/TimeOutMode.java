package microservices.taskmanager.timeout.enums;

/**
 * How a task's time_out value is turned into a deadline.
 */
public enum TimeOutMode {
    /** time_out is the time of day at which the task becomes overdue. */
    TIME_OF_DAY,
    /** time_out is a duration counted back from time_cloture. */
    BEFORE_CLOSURE
}
