package br.edu.ifba.asrgot.scheduler;

/**
 * Scheduling priority. Declaration order is dispatch order.
 */
public enum TaskPriority {
    HIGH,
    MEDIUM,
    LOW
}
