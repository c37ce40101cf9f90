package com.safepocket.forecast.model;

public enum Category {
    UNCATEGORIZED,
    SALARY,
    TAX_CREDIT,
    BENEFITS,
    HOUSE_LOAN,
    WORKS_LOAN,
    RENT,
    LOAN_INSURANCE,
    HOUSE_WORKS,
    FURNITURE,
    SAVINGS,
    CAR_INSURANCE,
    HOUSE_INSURANCE,
    OTHER_INSURANCE,
    CHILDCARE,
    CHILD_SUPPORT,
    ENTERTAINMENT,
    LEISURE,
    HOLIDAYS,
    ELECTRICITY,
    WATER,
    INTERNET,
    PHONE,
    GROCERIES,
    CLOTHING,
    HEALTH_CARE,
    CARE,
    PUBLIC_TRANSPORT,
    CAR_FUEL,
    PARKING,
    TOLL,
    CAR_MAINTENANCE,
    CAR_LOAN,
    GIFTS,
    PROFESSIONAL_EXPENSES,
    OTHER,
    CHARITY,
    BANK_FEES,
    TAXES
}
