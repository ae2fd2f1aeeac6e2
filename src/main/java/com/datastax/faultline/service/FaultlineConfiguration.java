/*
 * Copyright 2021 DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.datastax.faultline.service;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.Configuration;

import com.datastax.faultline.engine.RetryPolicy;
import com.datastax.faultline.util.Duration;

public class FaultlineConfiguration extends Configuration
{
    @JsonProperty
    @NotEmpty
    private String templatesDir = Paths.get("templates").toString();

    @JsonProperty
    @NotEmpty
    private String templateIndex = "index.yaml";

    @JsonProperty
    @NotEmpty
    private String defaultNamespace = "chaos-testing";

    /** Longest TTL a request may ask for */
    @JsonProperty
    @NotNull
    private Duration maxTtl = Duration.hours(24);

    /** Where instances are persisted; absent means they are kept in memory only */
    @JsonProperty
    private Optional<String> stateDir = Optional.empty();

    /** How long REVERTED and REJECTED instances stay queryable */
    @JsonProperty
    @NotNull
    private Duration finishedRetention = Duration.hours(24);

    /** How long a submit waits for overlapping submits to activate before giving up with a conflict */
    @JsonProperty
    @NotNull
    private Duration scopeLockTimeout = Duration.seconds(30);

    @JsonProperty
    @Valid
    @NotNull
    private ReconciliationConfig reconciliation = new ReconciliationConfig();

    @JsonProperty
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    @JsonProperty
    @Valid
    @NotNull
    private KubectlConfig kubectl = new KubectlConfig();

    public static class ReconciliationConfig
    {
        @JsonProperty
        @NotNull
        private Duration initialDelay = Duration.seconds(10);

        @JsonProperty
        @NotNull
        private Duration interval = Duration.seconds(30);

        /** How long a pass waits for a busy instance before skipping it */
        @JsonProperty
        @NotNull
        private Duration ownershipWait = Duration.milliseconds(500);

        /** How long an ACTIVE instance's backend may stay unreachable before it is FAILED_PARTIAL */
        @JsonProperty
        @NotNull
        private Duration unknownGracePeriod = Duration.minutes(5);

        @JsonProperty
        private boolean startPaused = false;

        public Duration getInitialDelay()
        {
            return initialDelay;
        }

        public Duration getInterval()
        {
            return interval;
        }

        public Duration getOwnershipWait()
        {
            return ownershipWait;
        }

        public Duration getUnknownGracePeriod()
        {
            return unknownGracePeriod;
        }

        public boolean isStartPaused()
        {
            return startPaused;
        }
    }

    public static class RetryConfig
    {
        @JsonProperty
        @Min(1)
        private int maxAttempts = 4;

        @JsonProperty
        @NotNull
        private Duration initialBackoff = Duration.milliseconds(500);

        @JsonProperty
        @NotNull
        private Duration maxBackoff = Duration.seconds(10);

        @JsonProperty
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        public RetryPolicy toRetryPolicy()
        {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, multiplier);
        }
    }

    public static class KubectlConfig
    {
        @JsonProperty
        @NotEmpty
        private String executable = "kubectl";

        @JsonProperty
        private Optional<String> context = Optional.empty();

        @JsonProperty
        private Optional<String> kubeconfig = Optional.empty();

        @JsonProperty
        @NotNull
        private Duration commandTimeout = Duration.seconds(60);

        public String getExecutable()
        {
            return executable;
        }

        public Optional<String> getContext()
        {
            return context;
        }

        public Optional<String> getKubeconfig()
        {
            return kubeconfig;
        }

        public Duration getCommandTimeout()
        {
            return commandTimeout;
        }
    }

    public Path getTemplatesDir()
    {
        return Paths.get(templatesDir);
    }

    public String getTemplateIndex()
    {
        return templateIndex;
    }

    public String getDefaultNamespace()
    {
        return defaultNamespace;
    }

    public Duration getMaxTtl()
    {
        return maxTtl;
    }

    public Optional<Path> getStateDir()
    {
        return stateDir.map(Paths::get);
    }

    public Duration getFinishedRetention()
    {
        return finishedRetention;
    }

    public Duration getScopeLockTimeout()
    {
        return scopeLockTimeout;
    }

    public ReconciliationConfig getReconciliation()
    {
        return reconciliation;
    }

    public RetryConfig getRetry()
    {
        return retry;
    }

    public KubectlConfig getKubectl()
    {
        return kubectl;
    }
}
