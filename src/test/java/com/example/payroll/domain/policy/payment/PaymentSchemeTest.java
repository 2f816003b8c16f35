package com.example.payroll.domain.policy.payment;

import static org.assertj.core.api.Assertions.*;

import java.math.BigDecimal;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import com.example.payroll.domain.policy.bonus.FixedBonus;
import com.example.payroll.domain.policy.bonus.PercentOfBaseBonus;
import com.example.payroll.domain.policy.bonus.PlanPerformanceBonus;

class PaymentSchemeTest {
	static final BigDecimal ZERO = BigDecimal.ZERO;

	static Stream<PaymentScheme> allSchemes() {
		return Stream.of(new FixedSalaryWithBonus(), new PercentProductionWithBonus(), new PercentPlanWithBonus());
	}

	@ParameterizedTest
	@Tag("regression")
	@MethodSource("allSchemes")
	@DisplayName("どのスキームも plan == 0 で例外を投げない")
	void every_scheme_is_defined_when_plan_is_zero(PaymentScheme sut) {
		assertThatCode(() -> sut.calculate(new BigDecimal("1000"), new BigDecimal("50"), ZERO, new BigDecimal("3")))
				.doesNotThrowAnyException();
		assertThatCode(() -> sut.calculate(new BigDecimal("1000"), new PlanPerformanceBonus(), ZERO, ZERO))
				.doesNotThrowAnyException();
	}

	@Nested
	class FixedSalaryWithBonusTest {
		@Test
		@DisplayName("base + bonus")
		void adds_bonus_to_base() {
			PaymentScheme sut = new FixedSalaryWithBonus();

			assertThat(sut.calculate(new BigDecimal("2000"), new BigDecimal("300"), new BigDecimal("10"),
					new BigDecimal("4"))).isEqualByComparingTo("2300");
		}
	}

	@Nested
	class PercentProductionWithBonusTest {
		@Test
		@DisplayName("actual × base + bonus")
		void pays_base_per_unit_of_production() {
			PaymentScheme sut = new PercentProductionWithBonus();

			assertThat(sut.calculate(new BigDecimal("100"), new BigDecimal("10"), ZERO, new BigDecimal("5")))
					.isEqualByComparingTo("510");
		}

		@Test
		void no_production_leaves_only_bonus() {
			PaymentScheme sut = new PercentProductionWithBonus();

			assertThat(sut.calculate(new BigDecimal("100"), new BigDecimal("10"), ZERO, ZERO))
					.isEqualByComparingTo("10");
		}
	}

	@Nested
	class PercentPlanWithBonusTest {
		PaymentScheme sut = new PercentPlanWithBonus();

		@ParameterizedTest
		@DisplayName("plan > 0 のとき (actual / plan) × base + bonus")
		@CsvSource({
				"1000, 50, 200, 150, 800",
				"1000, 0, 200, 200, 1000",
				"1000, 0, 200, 300, 1500",
				"1200, 100, 400, 0, 100" })
		void pays_share_of_plan_completion(String base, String bonus, String plan, String actual, String expected) {
			assertThat(sut.calculate(new BigDecimal(base), new BigDecimal(bonus), new BigDecimal(plan),
					new BigDecimal(actual))).isEqualByComparingTo(expected);
		}

		@Test
		@Tag("anchor")
		@DisplayName("plan == 0 のとき bonus のみ")
		void returns_bonus_alone_when_plan_is_zero() {
			assertThat(sut.calculate(new BigDecimal("1000"), new BigDecimal("75"), ZERO, new BigDecimal("40")))
					.isEqualByComparingTo("75");
		}
	}

	@Nested
	class BonusSchemeOverloadTest {
		@Test
		@DisplayName("賞与ルールは同じ base/plan/actual で評価される")
		void evaluates_bonus_scheme_with_same_arguments() {
			var bonus = new PlanPerformanceBonus();
			PaymentScheme sut = new PercentPlanWithBonus();
			var base = new BigDecimal("1000");
			var plan = new BigDecimal("200");
			var actual = new BigDecimal("100");

			// 1000 * 100/200 + 0.2 * 1000 * 100/200 = 500 + 100
			assertThat(sut.calculate(base, bonus, plan, actual)).isEqualByComparingTo("600");
		}

		@Test
		void percent_of_base_bonus_with_production_pay() {
			PaymentScheme sut = new PercentProductionWithBonus();

			assertThat(sut.calculate(new BigDecimal("100"), new PercentOfBaseBonus(), ZERO, new BigDecimal("5")))
					.isEqualByComparingTo("510");
		}

		@Test
		void fixed_bonus_with_fixed_salary() {
			PaymentScheme sut = new FixedSalaryWithBonus();

			assertThat(sut.calculate(new BigDecimal("2000"), new FixedBonus(new BigDecimal("300")), ZERO, ZERO))
					.isEqualByComparingTo("2300");
		}
	}
}
