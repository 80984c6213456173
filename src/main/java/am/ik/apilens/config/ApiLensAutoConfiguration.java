package am.ik.apilens.config;

import java.time.InstantSource;

import am.ik.apilens.ApiLensProperties;
import am.ik.apilens.client.ApiLensClient;
import am.ik.apilens.client.IngestTransport;
import am.ik.apilens.client.RestClientIngestTransport;
import am.ik.apilens.web.ApiLensCaptureFilter;
import am.ik.apilens.web.ConsumerResolver;
import am.ik.apilens.web.PrincipalConsumerResolver;
import jakarta.servlet.DispatcherType;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.client.RestClient;

/**
 * Creates the {@link ApiLensClient} for the application context and, in servlet web
 * applications, registers {@link ApiLensCaptureFilter} in front of all other filters
 * except character encoding. The client is closed with the context, which drains the
 * queue.
 */
@AutoConfiguration(after = RestClientAutoConfiguration.class)
@EnableConfigurationProperties(ApiLensProperties.class)
public class ApiLensAutoConfiguration {

	/**
	 * Filter order, right after Spring Boot's character encoding filter.
	 */
	public static final int FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 1;

	@Bean
	@ConditionalOnMissingBean
	InstantSource instantSource() {
		return InstantSource.system();
	}

	@Bean
	@ConditionalOnMissingBean
	IngestTransport apiLensIngestTransport(ApiLensProperties properties,
			ObjectProvider<RestClient.Builder> restClientBuilder) {
		return new RestClientIngestTransport(restClientBuilder.getIfAvailable(RestClient::builder),
				properties.timeout());
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	ApiLensClient apiLensClient(ApiLensProperties properties, IngestTransport apiLensIngestTransport,
			InstantSource instantSource) {
		return new ApiLensClient(properties, apiLensIngestTransport, instantSource);
	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
	static class ServletCaptureConfiguration {

		@Bean
		@ConditionalOnMissingBean
		ConsumerResolver apiLensConsumerResolver() {
			return new PrincipalConsumerResolver();
		}

		@Bean
		@ConditionalOnMissingBean(name = "apiLensCaptureFilter")
		FilterRegistrationBean<ApiLensCaptureFilter> apiLensCaptureFilter(ApiLensClient apiLensClient,
				ApiLensProperties properties, ConsumerResolver consumerResolver, InstantSource instantSource) {
			ApiLensCaptureFilter filter = new ApiLensCaptureFilter(apiLensClient, properties.requestLogging(),
					consumerResolver, instantSource);
			FilterRegistrationBean<ApiLensCaptureFilter> registration = new FilterRegistrationBean<>(filter);
			registration.setName("apiLensCaptureFilter");
			registration.setOrder(FILTER_ORDER);
			registration.setDispatcherTypes(DispatcherType.REQUEST);
			return registration;
		}

	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(HealthIndicator.class)
	static class HealthConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "apiLensHealthIndicator")
		ApiLensHealthIndicator apiLensHealthIndicator(ApiLensClient apiLensClient) {
			return new ApiLensHealthIndicator(apiLensClient);
		}

	}

}
