package com.webshepherd.core.model;

/** WCAG 적합성 레벨 */
public enum WcagLevel { A, AA, AAA }
