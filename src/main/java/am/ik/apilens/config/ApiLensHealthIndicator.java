package am.ik.apilens.config;

import am.ik.apilens.client.ApiLensClient;

import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

/**
 * Reports the ingest client state. The client is {@code UP} while it is enabled and
 * {@code OUT_OF_SERVICE} once shut down or disabled; queue depth and the dropped record
 * count are included as details.
 */
public class ApiLensHealthIndicator extends AbstractHealthIndicator {

	private final ApiLensClient client;

	public ApiLensHealthIndicator(ApiLensClient client) {
		super("API Lens health check failed");
		this.client = client;
	}

	@Override
	protected void doHealthCheck(Health.Builder builder) {
		if (this.client.isEnabled()) {
			builder.up();
		}
		else {
			builder.outOfService();
		}
		builder.withDetail("endpoint", this.client.endpoint().toString())
			.withDetail("running", this.client.isRunning())
			.withDetail("queueSize", this.client.queueSize())
			.withDetail("droppedCount", this.client.droppedCount());
	}

}
