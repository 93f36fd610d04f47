package com.ivamare.architecture.container;

/**
 * Callback that contributes bindings before the container starts.
 *
 * <p>Declare beans of this type to plug providers into the auto-configured container.
 */
@FunctionalInterface
public interface ContainerConfigurer {

    void configure(Container container);
}
