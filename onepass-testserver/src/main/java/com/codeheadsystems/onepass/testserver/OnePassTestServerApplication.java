package com.codeheadsystems.onepass.testserver;

import com.codeheadsystems.onepass.dropwizard.OnePassBundle;
import com.codeheadsystems.onepass.dropwizard.OnePassConfiguration;
import com.codeheadsystems.onepass.server.store.InMemoryDocumentStore;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local developer testing of pass issuance and entry scanning.
 * Users, tickets and events live in memory and are lost on restart, but the signing keys and JWT
 * secret come from {@code config/config.yml} so issued QR codes stay verifiable across restarts
 * as long as the configured keys do not change.
 *
 * <p>On startup a small demo data set is seeded and a bearer token is logged for each demo user.
 */
public class OnePassTestServerApplication extends Application<OnePassConfiguration> {

  private final InMemoryDocumentStore documentStore = new InMemoryDocumentStore();
  private final OnePassBundle<OnePassConfiguration> bundle = new OnePassBundle<>(documentStore);

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new OnePassTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "onepass-testserver";
  }

  @Override
  public void initialize(Bootstrap<OnePassConfiguration> bootstrap) {
    // ${ENV_VAR:-default} substitution lets Docker override single keys without replacing the file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(OnePassConfiguration configuration, Environment environment) {
    environment.jersey().register(new WhoAmIResource(documentStore));
    // The bundle has already registered its provisioning listener, so demo users get passes here.
    new DemoDataSeeder(documentStore, bundle.getJwtManager()).seed();
  }
}
