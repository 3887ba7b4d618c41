package app.adlens.media.config;

import app.adlens.media.client.fetch.FetchProps;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClientCustomizer timeoutCustomizer(FetchProps props) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.connectTimeout());
            factory.setReadTimeout(props.readTimeout());
            builder.requestFactory(factory);
        };
    }
}
