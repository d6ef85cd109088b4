package com.doctext.text.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class EntityValidatorsTest {

    @Test
    void cnpjCheckDigits() {
        assertThat(EntityValidators.isValidCnpj("11.222.333/0001-81")).isTrue();
        assertThat(EntityValidators.isValidCnpj("11222333000181")).isTrue();
        assertThat(EntityValidators.isValidCnpj("11.222.333/0001-80")).isFalse();
        assertThat(EntityValidators.isValidCnpj("11111111111111")).isFalse();
        assertThat(EntityValidators.isValidCnpj("1122233300018")).isFalse();
        assertThat(EntityValidators.isValidCnpj(null)).isFalse();
    }

    @Test
    void cpfCheckDigits() {
        assertThat(EntityValidators.isValidCpf("529.982.247-25")).isTrue();
        assertThat(EntityValidators.isValidCpf("529.982.247-24")).isFalse();
        assertThat(EntityValidators.isValidCpf("111.111.111-11")).isFalse();
        assertThat(EntityValidators.isValidCpf("")).isFalse();
        assertThat(EntityValidators.isValidCpf("５２９.９８２.２４７-２５")).isTrue();
    }

    @Test
    void extractedCandidatesCanBeFilteredByCallers() {
        assertThat(EntityExtractors.taxIds("CNPJ 11.222.333/0001-81"))
            .filteredOn(EntityValidators::isValidCnpj)
            .containsExactly("11222333000181");
    }

    @Test
    void cepAndPhoneLengths() {
        assertThat(EntityValidators.isValidCep("01310-100")).isTrue();
        assertThat(EntityValidators.isValidCep("0131-010")).isFalse();
        assertThat(EntityValidators.isValidPhone("(11) 3456-7890")).isTrue();
        assertThat(EntityValidators.isValidPhone("(11) 98765-4321")).isTrue();
        assertThat(EntityValidators.isValidPhone("98765-4321")).isFalse();
    }

    @Test
    void emails() {
        assertThat(EntityValidators.isValidEmail("contato@empresa.com.br")).isTrue();
        assertThat(EntityValidators.isValidEmail("contato@empresa")).isFalse();
        assertThat(EntityValidators.isValidEmail(" contato@empresa.com")).isFalse();
        assertThat(EntityValidators.isValidEmail(null)).isFalse();
    }

    @Test
    void datesAreCheckedAgainstTheCalendar() {
        assertThat(EntityValidators.isValidDate("29/02/2024")).isTrue();
        assertThat(EntityValidators.isValidDate("29/02/2023")).isFalse();
        assertThat(EntityValidators.isValidDate("99/99/9999")).isFalse();
        assertThat(EntityValidators.isValidDate("2024-01-20", "uuuu-MM-dd")).isTrue();
        assertThat(EntityValidators.isValidDate(null)).isFalse();
    }

    @Test
    void monetaryShapes() {
        assertThat(EntityValidators.isValidMonetaryValue("R$ 1.234,56")).isTrue();
        assertThat(EntityValidators.isValidMonetaryValue("r$ 10")).isTrue();
        assertThat(EntityValidators.isValidMonetaryValue("50 reais")).isTrue();
        assertThat(EntityValidators.isValidMonetaryValue("1 real")).isTrue();
        assertThat(EntityValidators.isValidMonetaryValue("R$ 1.234,56 extra")).isFalse();
        assertThat(EntityValidators.isValidMonetaryValue("cinquenta reais")).isFalse();
        assertThat(EntityValidators.isValidMonetaryValue("")).isFalse();
    }
}
