package eventmanager.spring.boot;

import eventmanager.EventHandler;
import eventmanager.EventType;
import eventmanager.Handler;
import eventmanager.dispatch.EventDispatcher;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Arrays;
import java.util.Map;

/**
 * Scans for beans annotated with {@link EventSubscriber} and registers them with the
 * {@link EventDispatcher}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final EventDispatcher dispatcher;

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, EventDispatcher dispatcher) {
        this.beanFactory = beanFactory;
        this.dispatcher = dispatcher;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler callback)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            EventSubscriber annotation = bean.getClass().getAnnotation(EventSubscriber.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscriber.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + bean.getClass().getName());
            }

            String eventTypeName = resolveEventType(beanName, annotation);
            String key = annotation.key().isEmpty() ? beanName : annotation.key();

            dispatcher.addHandler(eventTypeName, Handler.of(annotation.priority(), key, callback));
        }
    }

    private String resolveEventType(String beanName, EventSubscriber annotation) {
        Class<? extends EventType> eventTypeClass = annotation.eventTypeClass();
        String eventType = annotation.eventType();
        if (eventTypeClass != EventType.class) {
            if (eventTypeClass.isEnum()) {
                return selectEnumConstant(beanName, eventTypeClass, eventType);
            }
            return instantiateAndGetName(beanName, eventTypeClass);
        }
        if (eventType.isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@EventSubscriber must specify either eventType or eventTypeClass");
        }
        return eventType;
    }

    private String selectEnumConstant(String beanName, Class<? extends EventType> clazz, String eventType) {
        EventType[] constants = clazz.getEnumConstants();
        if (constants.length == 0) {
            throw new BeanCreationException(beanName,
                    "@EventSubscriber eventTypeClass enum " + clazz.getName() + " has no constants");
        }
        if (eventType.isEmpty()) {
            if (constants.length > 1) {
                throw new BeanCreationException(beanName,
                        "@EventSubscriber eventTypeClass enum " + clazz.getName() + " declares "
                                + Arrays.toString(constants) + "; set eventType to pick one");
            }
            return constants[0].name();
        }
        for (EventType constant : constants) {
            if (constant.name().equals(eventType)) {
                return eventType;
            }
        }
        throw new BeanCreationException(beanName,
                "@EventSubscriber eventType '" + eventType + "' is not a constant of " + clazz.getName());
    }

    private String instantiateAndGetName(String beanName, Class<? extends EventType> clazz) {
        try {
            return clazz.getDeclaredConstructor().newInstance().name();
        } catch (Exception e) {
            throw new BeanCreationException(beanName,
                    "Failed to instantiate @EventSubscriber eventTypeClass: " + clazz.getName(), e);
        }
    }
}
