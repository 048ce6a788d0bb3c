package com.costwatch.anomaly.config;

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
                        .title("Cost Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Rule-based anomaly detection for utility and invoice cost records.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a cost record with its history via `POST /anomalies/detect`\n" +
                                "2. Select enabled checks applicable to the record's cost type\n" +
                                "3. Skip checks whose history requirement is not met\n" +
                                "4. Run each check in isolation and collect anomalies\n" +
                                "5. Store anomalies (one per record and check) and alert on live, non-backfill ones\n\n" +
                                "**Checks:**\n" +
                                "- `yoy_deviation`: deviation from the same month last year\n" +
                                "- `mom_deviation`: deviation from the previous period\n" +
                                "- `price_per_unit_spike`: price per unit above the recent average\n" +
                                "- `statistical_outlier`: z-score of the amount\n" +
                                "- `duplicate_detection`: same supplier, similar amount, close dates\n" +
                                "- `missing_period`: gaps in recurring invoices\n" +
                                "- `seasonal_anomaly`: deviation from the seasonal expectation\n" +
                                "- `budget_exceeded`: month-to-date total against the budget")
                        .contact(new Contact().name("Cost Watch Team")));
    }
}
