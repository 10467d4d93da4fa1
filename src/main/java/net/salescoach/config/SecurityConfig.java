/**
 * Configuration class for Spring Security settings
 *
 * Features:
 * - Requires HTTP Basic authentication on every /api/** endpoint
 * - Stateless sessions, so no cookie can carry credentials across requests
 * - Defines the in-memory API user from app.security.user.* properties
 */
package net.salescoach.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.util.StringUtils;

@Configuration
@EnableWebSecurity
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    private final ApiBasicAuthenticationEntryPoint apiBasicAuthenticationEntryPoint;
    private final Environment environment;

    public SecurityConfig(ApiBasicAuthenticationEntryPoint apiBasicAuthenticationEntryPoint,
                          Environment environment) {
        this.apiBasicAuthenticationEntryPoint = apiBasicAuthenticationEntryPoint;
        this.environment = environment;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityMatcher("/**")
            .authorizeHttpRequests(authorizeRequests ->
                authorizeRequests
                    .requestMatchers("/api/**").authenticated()
                    .anyRequest().permitAll()
            )
            .httpBasic(httpBasic -> httpBasic
                .authenticationEntryPoint(apiBasicAuthenticationEntryPoint)
            )
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            // No session cookies exist, so browsers cannot auto-attach credentials cross-origin.
            .csrf(csrf -> csrf.disable());
        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public UserDetailsService userDetailsService(PasswordEncoder passwordEncoder) {
        String username = resolve("app.security.user.username");
        String password = resolve("app.security.user.password");

        InMemoryUserDetailsManager userDetailsManager = new InMemoryUserDetailsManager();
        if (password != null) {
            userDetailsManager.createUser(User.builder()
                .username(username != null ? username : "user")
                .password(passwordEncoder.encode(password))
                .roles("USER")
                .build());
        } else {
            log.error("No basic-auth credentials configured (app.security.user.password). /api/** will respond with 401.");
        }
        return userDetailsManager;
    }

    private String resolve(String propertyKey) {
        String value = environment.getProperty(propertyKey);
        if (value == null || !StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }
}
