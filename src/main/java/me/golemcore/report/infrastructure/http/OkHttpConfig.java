package me.golemcore.report.infrastructure.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.report.infrastructure.config.ReportProperties;
import lombok.RequiredArgsConstructor;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client for the GitHub commit source and the Feishu notifier.
 *
 * <p>
 * Timeouts and pool sizing come from {@code report.http.*}. Every request
 * carries the configured User-Agent, which the GitHub API requires.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
public class OkHttpConfig {

    private final ReportProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        ReportProperties.HttpProperties http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(userAgent(http.getUserAgent()))
                .build();
    }

    static Interceptor userAgent(String userAgent) {
        return chain -> {
            Request request = chain.request();
            if (userAgent == null || userAgent.isBlank() || request.header("User-Agent") != null) {
                return chain.proceed(request);
            }
            return chain.proceed(request.newBuilder().header("User-Agent", userAgent).build());
        };
    }
}
