package com.intteq.fluent.broker.azure;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.messaging.servicebus.ServiceBusClientBuilder;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClientBuilder;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Azure Service Bus namespace access. Either a connection string or a fully-qualified namespace
 * is required; with a namespace and no explicit credential, Managed Identity (Azure AD) is used
 * through {@link DefaultAzureCredentialBuilder}.
 */
@Slf4j
@Getter
public final class AzureServiceBusConnection {

    static final String CONNECTION_STRING_ENV = "AZURE_SERVICEBUS_CONNECTION_STRING";

    private final String connectionString;
    private final String fullyQualifiedNamespace;
    private final TokenCredential credential;

    private AzureServiceBusConnection(Builder builder) {
        this.connectionString = builder.connectionString;
        this.fullyQualifiedNamespace = builder.fullyQualifiedNamespace;
        this.credential = builder.credential;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean usesManagedIdentity() {
        return connectionString == null;
    }

    public ServiceBusClientBuilder clientBuilder() {
        if (usesManagedIdentity()) {
            log.info("Azure Service Bus client using Managed Identity auth.");
            return new ServiceBusClientBuilder()
                    .fullyQualifiedNamespace(fullyQualifiedNamespace)
                    .credential(resolveCredential());
        }
        return new ServiceBusClientBuilder().connectionString(connectionString);
    }

    public ServiceBusAdministrationClient adminClient() {
        if (usesManagedIdentity()) {
            log.info("Azure Service Bus admin client using Managed Identity auth.");
            return new ServiceBusAdministrationClientBuilder()
                    .endpoint("https://" + fullyQualifiedNamespace)
                    .credential(resolveCredential())
                    .buildClient();
        }
        return new ServiceBusAdministrationClientBuilder()
                .connectionString(connectionString)
                .buildClient();
    }

    private TokenCredential resolveCredential() {
        return credential != null ? credential : new DefaultAzureCredentialBuilder().build();
    }

    @Override
    public String toString() {
        return "AzureServiceBusConnection[" + (usesManagedIdentity()
                ? "namespace=" + fullyQualifiedNamespace
                : "connectionString=***") + "]";
    }

    public static final class Builder {

        private String connectionString;
        private String fullyQualifiedNamespace;
        private TokenCredential credential;

        private Builder() {
        }

        public Builder setConnectionString(String connectionString) {
            this.connectionString = connectionString;
            return this;
        }

        /** e.g. {@code my-namespace.servicebus.windows.net}. */
        public Builder setFullyQualifiedNamespace(String fullyQualifiedNamespace) {
            this.fullyQualifiedNamespace = fullyQualifiedNamespace;
            return this;
        }

        public Builder setCredential(TokenCredential credential) {
            this.credential = credential;
            return this;
        }

        /**
         * Falls back to the {@code AZURE_SERVICEBUS_CONNECTION_STRING} environment variable when
         * neither a connection string nor a namespace was given.
         */
        public AzureServiceBusConnection build() {
            if (isBlank(connectionString) && isBlank(fullyQualifiedNamespace)) {
                String env = System.getenv(CONNECTION_STRING_ENV);
                if (isBlank(env)) {
                    throw new MissingRequiredFieldException("AzureServiceBusConnection", "connectionString");
                }
                connectionString = env;
            }
            if (isBlank(connectionString)) {
                connectionString = null;
                log.warn("No connection string provided → using Managed Identity (Azure AD) for {}",
                        fullyQualifiedNamespace);
            }
            return new AzureServiceBusConnection(this);
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
