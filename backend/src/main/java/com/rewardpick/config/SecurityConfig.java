package com.rewardpick.config;

import com.rewardpick.auth.security.AdminKeyAuthenticationFilter;
import com.rewardpick.auth.security.AdminProperties;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableConfigurationProperties({
    AdminProperties.class,
    AppCorsProperties.class
})
public class SecurityConfig {

    private final AdminKeyAuthenticationFilter adminKeyAuthenticationFilter;
    private final AppCorsProperties corsProperties;

    public SecurityConfig(AdminKeyAuthenticationFilter adminKeyAuthenticationFilter, AppCorsProperties corsProperties) {
        this.adminKeyAuthenticationFilter = adminKeyAuthenticationFilter;
        this.corsProperties = corsProperties;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .sessionManagement(config -> config.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .exceptionHandling(config -> config.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/error", "/actuator/health").permitAll()
                .requestMatchers("/api/admin/**").hasAuthority(AdminKeyAuthenticationFilter.ROLE_ADMIN)
                .requestMatchers("/api/recommendations/**", "/api/catalog/**", "/api/users/**").permitAll()
                .anyRequest().denyAll()
            )
            .addFilterBefore(adminKeyAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
            .build();
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(corsProperties.originsOrDefault());
        configuration.setAllowedMethods(corsProperties.methodsOrDefault());
        configuration.setAllowedHeaders(List.of("*"));
        configuration.setMaxAge(corsProperties.maxAgeOrDefault());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
