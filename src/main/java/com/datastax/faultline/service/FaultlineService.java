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

import javax.ws.rs.core.Response;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

import com.google.common.annotations.VisibleForTesting;
import io.dropwizard.Application;
import io.dropwizard.jersey.errors.IllegalStateExceptionMapper;
import io.dropwizard.lifecycle.AutoCloseableManager;
import io.dropwizard.lifecycle.Managed;
import io.dropwizard.setup.Bootstrap;
import io.dropwizard.setup.Environment;
import io.netty.util.HashedWheelTimer;
import org.glassfish.jersey.server.internal.LocalizationMessages;

import com.datastax.faultline.backends.BackendAdapters;
import com.datastax.faultline.backends.UnsupportedBackendAdapter;
import com.datastax.faultline.backends.chaos_mesh.ChaosMeshBackendAdapter;
import com.datastax.faultline.backends.custom.CustomBackendAdapter;
import com.datastax.faultline.backends.kubernetes.LocalKubeControl;
import com.datastax.faultline.engine.OrchestrationEngine;
import com.datastax.faultline.lifecycle.FaultInstanceStore;
import com.datastax.faultline.lifecycle.FaultLifecycleManager;
import com.datastax.faultline.lifecycle.FileFaultInstanceStore;
import com.datastax.faultline.lifecycle.InMemoryFaultInstanceStore;
import com.datastax.faultline.rendering.MustacheTemplateRenderer;
import com.datastax.faultline.requests.RequestValidator;
import com.datastax.faultline.service.cli.ValidateTemplatesCommand;
import com.datastax.faultline.service.core.ReconciliationTask;
import com.datastax.faultline.service.resources.FaultResource;
import com.datastax.faultline.service.resources.TemplateResource;
import com.datastax.faultline.templates.BackendKind;
import com.datastax.faultline.templates.FileTemplateSource;
import com.datastax.faultline.templates.TemplateRegistry;
import com.datastax.faultline.util.JacksonUtils;
import com.datastax.faultline.util.NamedThreadFactory;
import com.datastax.faultline.util.ScopedLogger;

public class FaultlineService extends Application<FaultlineConfiguration>
{
    private static final ScopedLogger logger = ScopedLogger.getLogger(FaultlineService.class);

    private OrchestrationEngine engine;
    private ReconciliationTask reconciliationTask;

    @Override
    public String getName()
    {
        return "faultline";
    }

    @Override
    public void initialize(Bootstrap<FaultlineConfiguration> bootstrap)
    {
        bootstrap.addCommand(new ValidateTemplatesCommand());
        bootstrap.setObjectMapper(JacksonUtils.getObjectMapper());
    }

    private static class LifecycleManager
    {
        private final Environment environment;

        private LifecycleManager(Environment environment)
        {
            this.environment = environment;
        }

        public <T extends Managed> T manage(T object)
        {
            environment.lifecycle().manage(object);
            return object;
        }

        public <T> T manage(T object, Consumer<T> onClose)
        {
            manage(new AutoCloseableManager(() -> onClose.accept(object)));
            return object;
        }
    }

    /** Build the engine and everything it depends on from the configuration.  Fails if the templates
     *  are invalid or the persisted instances cannot be read, so the server never starts half-configured. */
    @VisibleForTesting
    static OrchestrationEngine createEngine(FaultlineConfiguration conf, ExecutorService kubectlIoExecutor,
        Clock clock)
    {
        final var renderer = new MustacheTemplateRenderer();

        final var kubectl = conf.getKubectl();
        final var kubeControl = new LocalKubeControl(kubectl.getExecutable(), kubectl.getContext(),
            kubectl.getKubeconfig(), kubectlIoExecutor);

        final var adapters = new BackendAdapters(List.of(
            new ChaosMeshBackendAdapter(renderer, kubeControl, kubectl.getCommandTimeout()),
            new UnsupportedBackendAdapter(BackendKind.CHAOSD),
            CustomBackendAdapter.withDiscoveredExecutors(renderer)));

        final FaultInstanceStore store = conf.getStateDir()
            .<FaultInstanceStore>map(FileFaultInstanceStore::new)
            .orElseGet(() -> {
                logger.warn("No stateDir configured: fault instances will not survive a restart");
                return new InMemoryFaultInstanceStore();
            });

        final var lifecycle = new FaultLifecycleManager(store, clock);
        final var recovered = lifecycle.recover();
        logger.info("Recovered {} fault instances", recovered);

        final var registry = TemplateRegistry.loadFrom(
            new FileTemplateSource(conf.getTemplatesDir(), conf.getTemplateIndex()));

        final var reconciliation = conf.getReconciliation();

        return OrchestrationEngine.builder()
            .withTemplateRegistry(registry)
            .withRequestValidator(new RequestValidator(conf.getMaxTtl()))
            .withBackendAdapters(adapters)
            .withLifecycleManager(lifecycle)
            .withRetryPolicy(conf.getRetry().toRetryPolicy())
            .withClock(clock)
            .withDefaultNamespace(conf.getDefaultNamespace())
            .withScopeLockTimeout(conf.getScopeLockTimeout())
            .withOwnershipWait(reconciliation.getOwnershipWait())
            .withUnknownGracePeriod(reconciliation.getUnknownGracePeriod())
            .withFinishedRetention(conf.getFinishedRetention())
            .build();
    }

    @Override
    public void run(FaultlineConfiguration conf, Environment environment)
    {
        final var m = new LifecycleManager(environment);

        final var kubectlIoExecutor = m.manage(
            Executors.newCachedThreadPool(new NamedThreadFactory("KubectlIO")), ExecutorService::shutdownNow);

        engine = createEngine(conf, kubectlIoExecutor, Clock.systemUTC());

        final var timer = m.manage(new HashedWheelTimer(new NamedThreadFactory("ServiceTimer")),
            HashedWheelTimer::stop);

        final var reconciliation = conf.getReconciliation();
        reconciliationTask = m.manage(new ReconciliationTask(reconciliation.isStartPaused(), timer,
            reconciliation.getInitialDelay(), reconciliation.getInterval(), engine));

        environment.admin().addTask(new ReloadTemplatesTask(engine));

        // Dropwizard's own IllegalStateExceptionMapper would otherwise take every IllegalStateException;
        // keep its form content type hint and map the rest ourselves.
        environment.jersey().register(new FaultEngineExceptionMapper<IllegalStateException>() {
            private final IllegalStateExceptionMapper dropwizardMapper = new IllegalStateExceptionMapper();

            @Override
            public Response toResponse(IllegalStateException exception)
            {
                if (LocalizationMessages.FORM_PARAM_CONTENT_TYPE_ERROR().equals(exception.getMessage()))
                {
                    return dropwizardMapper.toResponse(exception);
                }
                return super.toResponse(exception);
            }
        });
        environment.jersey().register(new FaultEngineExceptionMapper<>() {});
        environment.jersey().register(new FaultResource(engine));
        environment.jersey().register(new TemplateResource(engine));
    }

    @VisibleForTesting
    public OrchestrationEngine getEngine()
    {
        return engine;
    }

    @VisibleForTesting
    public ReconciliationTask getReconciliationTask()
    {
        return reconciliationTask;
    }

    public static void main(String[] args) throws Exception
    {
        new FaultlineService().run(args);
    }
}
