package br.com.bootcamptracker.backend.jobs;

/**
 * Job repetido registrado no scheduler.
 */
public record JobDescriptor(JobClass jobClass, String entityId, long intervalMs, String key) {

    public static JobDescriptor of(JobClass jobClass, String entityId, long intervalMs) {
        return new JobDescriptor(jobClass, entityId, intervalMs, JobKeys.jobKey(jobClass, entityId));
    }
}
