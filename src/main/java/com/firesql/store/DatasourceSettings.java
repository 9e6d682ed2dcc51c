package com.firesql.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * Identity and credentials of the document store a query runs against.
 */
public class DatasourceSettings {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final String projectId;
    private final String serviceAccount;

    public DatasourceSettings(String projectId, String serviceAccount) {
        this.projectId = projectId;
        this.serviceAccount = serviceAccount;
    }

    public String getProjectId() {
        return projectId;
    }

    /**
     * Service account JSON, or null/empty for application default credentials.
     */
    public String getServiceAccount() {
        return serviceAccount;
    }

    public boolean hasServiceAccount() {
        return serviceAccount != null && !serviceAccount.isBlank();
    }

    /**
     * Check the settings before any connection attempt.
     *
     * @throws DatasourceConfigException if the project id is missing or the
     *         service account is not JSON
     */
    public void validate() throws DatasourceConfigException {
        if (projectId == null || projectId.isBlank()) {
            throw new DatasourceConfigException("ProjectID is required");
        }
        if (hasServiceAccount()) {
            try {
                JSON.readTree(serviceAccount);
            } catch (JsonProcessingException e) {
                throw new DatasourceConfigException("invalid service account, it is expected to be a JSON", e);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatasourceSettings)) {
            return false;
        }
        DatasourceSettings that = (DatasourceSettings) o;
        return Objects.equals(projectId, that.projectId) && Objects.equals(serviceAccount, that.serviceAccount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, serviceAccount);
    }

    @Override
    public String toString() {
        // credentials are never printed
        return "DatasourceSettings{projectId=" + projectId + ", serviceAccount=" + (hasServiceAccount() ? "***" : "none") + "}";
    }
}
