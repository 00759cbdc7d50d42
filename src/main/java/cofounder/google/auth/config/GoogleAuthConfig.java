package cofounder.google.auth.config;

import cofounder.google.auth.callback.CallbackListenerFactory;
import cofounder.google.auth.callback.LoopbackCallbackListener;
import cofounder.google.auth.repository.CredentialStore;
import cofounder.google.auth.repository.FileCredentialStore;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.PrintStream;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(GoogleAuthProperties.class)
public class GoogleAuthConfig {

    @Bean
    public CredentialStore credentialStore(GoogleAuthProperties properties) {
        return new FileCredentialStore(properties.getCredentialsDir());
    }

    @Bean
    public CallbackListenerFactory callbackListenerFactory(GoogleAuthProperties properties) {
        return () -> new LoopbackCallbackListener(properties.getRedirectPort(), properties.getCallbackTimeout());
    }

    @Bean
    public RestTemplate tokenRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(30))
            .build();
    }

    @Bean
    public HttpTransport googleHttpTransport() throws GeneralSecurityException, IOException {
        return GoogleNetHttpTransport.newTrustedTransport();
    }

    @Bean
    public JsonFactory googleJsonFactory() {
        return GsonFactory.getDefaultInstance();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PrintStream consoleOut() {
        return System.out;
    }

    @Bean
    public PrintStream consoleErr() {
        return System.err;
    }
}
