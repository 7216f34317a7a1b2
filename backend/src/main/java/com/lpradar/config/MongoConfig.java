package com.lpradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: prices are stored as Decimal128, raw chain integers (sqrtPriceX96, liquidity,
 * tokenId) keep Spring Data's default string form so no precision is lost.
 * Indexes come from @CompoundIndex / @Indexed on the domain documents.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new BigDecimalToDecimal128Converter(),
                new Decimal128ToBigDecimalConverter()
        ));
    }
}
