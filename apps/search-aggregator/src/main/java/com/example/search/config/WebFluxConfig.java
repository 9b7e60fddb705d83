package com.example.search.config;

import com.example.search.identity.resolver.IdentityContextArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * Registers {@link IdentityContextArgumentResolver} so controllers can take an
 * {@link com.example.search.identity.model.IdentityContext} parameter.
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final IdentityContextArgumentResolver identityContextArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(identityContextArgumentResolver);
    }
}
