package com.example.sqlsentinel.config;

import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenizerSettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TokenizerConfig {
    @Bean
    public TokenizerSettings tokenizerSettings() {
        return TokenizerSettings.defaults();
    }

    @Bean
    public SqlTokenizer sqlTokenizer(TokenizerSettings tokenizerSettings) {
        return new SqlTokenizer(tokenizerSettings);
    }
}
