package com.cloudcost.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI costAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cloud Cost Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Flags days whose cloud spend is statistically unusual.\n\n" +
                                "**Detection:**\n" +
                                "1. Load the daily cost series for the requested window (`GET /costs`)\n" +
                                "2. Compute mean and population standard deviation over the whole window\n" +
                                "3. Score each day: `z = (cost - mean) / stdDev`\n" +
                                "4. Flag days with `|z| > threshold` (default 2.0, clamped to 1.0-5.0)\n" +
                                "5. Severity: **high** when `|z| > 3`, otherwise **medium**\n\n" +
                                "**Data sources** (`cost.data-source`):\n" +
                                "- `mock`: synthetic series with occasional injected spikes\n" +
                                "- `live`: daily totals aggregated from events posted to `POST /events`")
                        .contact(new Contact().name("Cloud Cost Team")));
    }
}
