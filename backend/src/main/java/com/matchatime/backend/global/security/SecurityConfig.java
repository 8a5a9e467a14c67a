package com.matchatime.backend.global.security;

import java.util.Arrays;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matchatime.backend.global.config.WebProperties;
import com.matchatime.backend.global.web.ClientIpResolver;
import com.matchatime.backend.global.web.RequestIdFilter;
import com.matchatime.backend.global.web.ratelimit.EndpointTierResolver;
import com.matchatime.backend.global.web.ratelimit.RateLimitFilter;
import com.matchatime.backend.global.web.ratelimit.RateLimiter;
import com.matchatime.backend.global.web.ratelimit.TimingNormalizationFilter;
import com.matchatime.backend.modules.auth.application.AccessTokenService;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

/**
 * Stateless security chain. The request pipeline filters are instantiated here rather than discovered as beans so
 * that their order is fixed: request id, rate limit, timing floor, access-token authentication.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Value("${app.cors.allowed-origins}")
    private String allowedOrigins;

    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final AccessTokenService accessTokenService;
    private final RateLimiter rateLimiter;
    private final EndpointTierResolver tierResolver;
    private final ClientIpResolver clientIpResolver;
    private final WebProperties webProperties;
    private final ObjectMapper objectMapper;

    public SecurityConfig(
            RestAuthenticationEntryPoint authenticationEntryPoint,
            AccessTokenService accessTokenService,
            RateLimiter rateLimiter,
            EndpointTierResolver tierResolver,
            ClientIpResolver clientIpResolver,
            WebProperties webProperties,
            ObjectMapper objectMapper
    ) {
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.accessTokenService = accessTokenService;
        this.rateLimiter = rateLimiter;
        this.tierResolver = tierResolver;
        this.clientIpResolver = clientIpResolver;
        this.webProperties = webProperties;
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable())
                .logout(logout -> logout.disable())
                .authorizeHttpRequests(authz -> authz
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .requestMatchers(
                                "/users/register",
                                "/users/login",
                                "/users/request-password-reset",
                                "/users/reset-password",
                                "/users/verify-email",
                                "/users/resend-verification"
                        ).permitAll()
                        .requestMatchers("/auth/refresh", "/auth/logout", "/auth/google", "/auth/callback").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().authenticated()
                )
                .exceptionHandling(handler -> handler.authenticationEntryPoint(authenticationEntryPoint))
                // same anchor for all four: insertion order is kept among equal positions
                .addFilterBefore(new RequestIdFilter(clientIpResolver), UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(new RateLimitFilter(rateLimiter, tierResolver, clientIpResolver, objectMapper),
                        UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(new TimingNormalizationFilter(tierResolver, webProperties.timing().floor()),
                        UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(new JwtAuthenticationFilter(accessTokenService),
                        UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList());
        config.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(Arrays.asList("*"));
        config.setExposedHeaders(Arrays.asList(RequestIdFilter.REQUEST_ID_HEADER, "Retry-After",
                RateLimitFilter.REMAINING_HEADER));
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
