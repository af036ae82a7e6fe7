package br.com.bootcamptracker.backend.jobs;

import java.util.Optional;

/**
 * Derivação centralizada das chaves determinísticas de job. A chave é a
 * identidade do job repetido e o que impede duplicatas.
 */
public final class JobKeys {

    private static final String SEPARATOR = "-";

    private JobKeys() {
    }

    public static String jobKey(JobClass jobClass, Object entityId) {
        if (jobClass == null || entityId == null) {
            throw new IllegalArgumentException("jobClass e entityId são obrigatórios");
        }
        String id = entityId.toString();
        if (id.isBlank()) {
            throw new IllegalArgumentException("entityId vazio para " + jobClass);
        }
        return jobClass.getKeyPrefix() + SEPARATOR + id;
    }

    /**
     * Extrai o entityId de uma chave da classe informada.
     *
     * @return vazio se a chave não pertence à classe
     */
    public static Optional<String> entityIdOf(JobClass jobClass, String key) {
        String prefix = jobClass.getKeyPrefix() + SEPARATOR;
        if (key == null || !key.startsWith(prefix) || key.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(key.substring(prefix.length()));
    }
}
