package com.barcode.reader.config;

import com.barcode.reader.model.BarcodeFormat;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI barcodeReaderApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Barcode Reader API")
                        .description("Decodes barcodes from uploaded images and raw YUV_420_888 camera frames. "
                                + "Format contract version " + BarcodeFormat.CONTRACT_VERSION + ".")
                        .version("1.0.0"));
    }
}
