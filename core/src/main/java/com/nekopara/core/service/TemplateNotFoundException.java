package com.nekopara.core.service;

/** 등록되지 않은 템플릿 이름으로 태스크가 실행되려 할 때. 해당 태스크만 FAIL 처리된다. */
public class TemplateNotFoundException extends RuntimeException {
    private final String template;

    public TemplateNotFoundException(String template) {
        super("Template '" + template + "' does not exist");
        this.template = template;
    }

    public String getTemplate() { return template; }
}
