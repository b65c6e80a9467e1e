package com.listing.reconciliation.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;

/**
 * Jakarta RS Application class with OpenAPI metadata for the reconciliation review API.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Listing Reconciliation API",
                version = "1.0.0",
                description = "Compares extracted dealer price lists with a seller's listings, stages the " +
                        "resulting creates, updates and deletes for review, and applies the selected ones.",
                license = @License(
                        name = "Apache 2.0",
                        url = "https://www.apache.org/licenses/LICENSE-2.0.html"
                )
        )
)
public class ReconciliationApplication extends Application {
}
