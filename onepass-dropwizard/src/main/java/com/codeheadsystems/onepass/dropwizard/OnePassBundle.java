package com.codeheadsystems.onepass.dropwizard;

import com.codeheadsystems.onepass.dropwizard.auth.OnePassAuthenticator;
import com.codeheadsystems.onepass.dropwizard.auth.OnePassPrincipal;
import com.codeheadsystems.onepass.dropwizard.health.SigningKeyHealthCheck;
import com.codeheadsystems.onepass.server.auth.AccessController;
import com.codeheadsystems.onepass.server.auth.JwtManager;
import com.codeheadsystems.onepass.server.credential.CredentialCodec;
import com.codeheadsystems.onepass.server.crypto.SignatureCodec;
import com.codeheadsystems.onepass.server.crypto.SigningKey;
import com.codeheadsystems.onepass.server.crypto.SigningKeyGenerator;
import com.codeheadsystems.onepass.server.manager.EntryValidator;
import com.codeheadsystems.onepass.server.manager.PassIssuer;
import com.codeheadsystems.onepass.server.manager.PassRevoker;
import com.codeheadsystems.onepass.server.manager.ProvisioningTrigger;
import com.codeheadsystems.onepass.server.resource.AccountResource;
import com.codeheadsystems.onepass.server.resource.EntryResource;
import com.codeheadsystems.onepass.server.resource.PassResource;
import com.codeheadsystems.onepass.server.store.DocumentStore;
import com.codeheadsystems.onepass.server.store.InMemoryDocumentStore;
import com.codeheadsystems.onepass.server.store.InMemoryKeyStore;
import com.codeheadsystems.onepass.server.store.KeyStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the OnePass pass service into an existing Dropwizard application.
 * <p>
 * Registers the pass, entry and account JAX-RS resources, the signing key health check, and the
 * JWT authentication filter. Requires an {@link OnePassConfiguration} block in the application's
 * YAML config.
 * <p>
 * Embed in your application with an in-memory store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new OnePassBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store, with keys taken from the configuration:
 * <pre>{@code
 *   bootstrap.addBundle(new OnePassBundle<>(myDocumentStore));
 * }</pre>
 * <p>
 * Or supply both the key store and the document store:
 * <pre>{@code
 *   bootstrap.addBundle(new OnePassBundle<>(myKeyStore, myDocumentStore));
 * }</pre>
 */
public class OnePassBundle<C extends OnePassConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(OnePassBundle.class);

  private final DocumentStore documentStore;
  private final Clock clock;
  private KeyStore keyStore;
  private JwtManager jwtManager;
  private ProvisioningTrigger provisioningTrigger;

  /**
   * Creates a bundle backed by an in-memory document store.
   * <p>
   * For dev/test only: all users, tickets and events are lost on restart.
   */
  public OnePassBundle() {
    this(new InMemoryDocumentStore());
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory document store. All users,       #
        # passes and tickets will be lost on restart.                   #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied document store, with signing keys read from
   * {@link OnePassConfiguration#getSigningKeys()}.
   */
  public OnePassBundle(DocumentStore documentStore) {
    this(null, documentStore, Clock.systemUTC());
  }

  /**
   * Creates a bundle backed by the supplied stores. Configured signing keys are ignored.
   */
  public OnePassBundle(KeyStore keyStore, DocumentStore documentStore) {
    this(keyStore, documentStore, Clock.systemUTC());
  }

  public OnePassBundle(KeyStore keyStore, DocumentStore documentStore, Clock clock) {
    this.keyStore = keyStore;
    this.documentStore = documentStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    if (keyStore == null) {
      keyStore = buildKeyStore(configuration);
    }
    jwtManager = buildJwtManager(configuration);

    AccessController accessController = new AccessController(documentStore);
    SignatureCodec signatureCodec = new SignatureCodec(keyStore);
    CredentialCodec credentialCodec = new CredentialCodec(environment.getObjectMapper());

    PassIssuer passIssuer = new PassIssuer(accessController, keyStore, signatureCodec,
        credentialCodec, documentStore, clock);
    PassRevoker passRevoker = new PassRevoker(accessController, documentStore, clock);
    EntryValidator entryValidator = new EntryValidator(accessController, credentialCodec,
        signatureCodec, documentStore, clock,
        Duration.ofSeconds(configuration.getReplayWindowSeconds()));

    provisioningTrigger = new ProvisioningTrigger(passIssuer);
    documentStore.addUserCreatedListener(provisioningTrigger);

    environment.jersey().register(new PassResource(passIssuer, passRevoker));
    environment.jersey().register(new EntryResource(entryValidator));
    environment.jersey().register(new AccountResource(accessController, documentStore));
    environment.healthChecks().register("signing-key", new SigningKeyHealthCheck(keyStore));

    // JWT auth filter
    OnePassAuthenticator authenticator = new OnePassAuthenticator(jwtManager);
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<OnePassPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(OnePassPrincipal.class));
  }

  /**
   * The token manager, available once the bundle has run. Identity providers use it to mint
   * tokens for signed-in users.
   */
  public JwtManager getJwtManager() {
    return jwtManager;
  }

  /**
   * The pass provisioning hook for identity-provider "user created" events, available once the
   * bundle has run.
   */
  public ProvisioningTrigger getProvisioningTrigger() {
    return provisioningTrigger;
  }

  public KeyStore getKeyStore() {
    return keyStore;
  }

  public DocumentStore getDocumentStore() {
    return documentStore;
  }

  private JwtManager buildJwtManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new JwtManager(secret, configuration.getJwtIssuer(),
        configuration.getJwtTtlSeconds(), clock);
  }

  private InMemoryKeyStore buildKeyStore(C configuration) {
    InMemoryKeyStore store = new InMemoryKeyStore();
    SigningKeyGenerator generator = new SigningKeyGenerator();
    Base64.Decoder decoder = Base64.getDecoder();

    for (SigningKeyConfiguration keyConfig : configuration.getSigningKeys()) {
      byte[] privateKey = decoder.decode(keyConfig.getPrivateKeyBase64());
      SigningKey key = generator.fromPrivateKey(keyConfig.getKeyId(), privateKey,
          keyConfig.isActive());
      String publicKeyBase64 = keyConfig.getPublicKeyBase64();
      if (publicKeyBase64 != null && !publicKeyBase64.isEmpty()
          && !Base64.getEncoder().encodeToString(key.publicKey()).equals(publicKeyBase64)) {
        throw new IllegalStateException(
            "Configured public key does not match private key for " + keyConfig.getKeyId());
      }
      if (keyConfig.getRevokedAt() != null) {
        key = key.withRevokedAt(keyConfig.getRevokedAt());
      }
      store.store(key);
    }

    if (configuration.getSigningKeys().stream().noneMatch(SigningKeyConfiguration::isActive)) {
      String keyId = "ephemeral-" + UUID.randomUUID().toString().substring(0, 8);
      log.warn("""
          #################################################################
          # WARNING: No active signing key configured. Generated an      #
          # ephemeral key; passes will not verify after a restart.       #
          # Do not use in production.                                     #
          #################################################################
          """);
      store.store(generator.generate(keyId, true));
    }
    return store;
  }
}
