package com.syntegra.assessment.modules.scoring.handler;

import com.syntegra.assessment.modules.catalog.QuestionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class QuestionTypeHandlerRegistry {

    private final Map<QuestionType, QuestionTypeHandler> handlerMap = new EnumMap<>(QuestionType.class);

    public QuestionTypeHandlerRegistry(List<QuestionTypeHandler> handlers) {
        handlers.forEach(handler -> handlerMap.put(handler.supportedType(), handler));
        log.info("Question type handlers registered for: {}", handlerMap.keySet());
    }

    public QuestionTypeHandler getHandler(QuestionType type) {
        QuestionTypeHandler handler = handlerMap.get(type);
        if (handler == null) {
            throw new UnsupportedOperationException("No handler for type " + type);
        }
        return handler;
    }
}
